package org.iceforge.s3handler.aws.s3;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class KeyIteratorTest {

    private S3Client s3;

    @BeforeEach
    void setUp() {
        s3 = mock(S3Client.class);
    }

    private static List<String> drain(Iterator<String> it) {
        List<String> out = new ArrayList<>();
        it.forEachRemaining(out::add);
        return out;
    }

    private static S3Object obj(String key) {
        return S3Object.builder().key(key).size(1L).build();
    }

    @Test
    void tenThousandAndOneKeysTakeTwoCalls() {
        String[] keys = new String[10_001];
        for (int i = 0; i < keys.length; i++) {
            keys[i] = String.format("data/part-%05d", i);
        }
        InMemoryS3 store = new InMemoryS3().bucket("b", keys);
        store.install(s3);

        List<String> listed = drain(new AwsSdkS3Handler(s3).iterateKeys("b", "data/"));

        assertThat(listed).containsExactly(keys);
        assertThat(store.listRequests).hasSize(2);
        assertThat(store.listRequests.get(0).maxKeys()).isEqualTo(AwsSdkS3Handler.DEFAULT_KEYS_PER_PAGE);
        assertThat(store.listRequests.get(0).startAfter()).isNull();
        assertThat(store.listRequests.get(1).startAfter()).isEqualTo("data/part-09999");
        assertThat(store.listRequests).allSatisfy(r -> assertThat(r.delimiter()).isNull());
    }

    @Test
    void stopsWhenNotTruncatedEvenIfPageIsFull() {
        when(s3.listObjectsV2(any(ListObjectsV2Request.class))).thenReturn(ListObjectsV2Response.builder()
                .contents(obj("k1"), obj("k2"), obj("k3"))
                .isTruncated(false)
                .build());

        assertThat(drain(new KeyIterator(s3, "b", "", 3))).containsExactly("k1", "k2", "k3");
        verify(s3, times(1)).listObjectsV2(any(ListObjectsV2Request.class));
    }

    @Test
    void keepsPagingWhileTruncated() {
        when(s3.listObjectsV2(any(ListObjectsV2Request.class)))
                .thenReturn(ListObjectsV2Response.builder().contents(obj("a"), obj("b")).isTruncated(true).build())
                .thenReturn(ListObjectsV2Response.builder().contents(obj("c")).isTruncated(false).build());

        assertThat(drain(new KeyIterator(s3, "b", "", 2))).containsExactly("a", "b", "c");
        verify(s3).listObjectsV2(ListObjectsV2Request.builder().bucket("b").prefix("").maxKeys(2).startAfter("b").build());
    }

    @Test
    void onlyKeysUnderPrefix() {
        new InMemoryS3().bucket("b", "logs/2024/a", "logs/2025/b", "logsx", "other/c").install(s3);

        assertThat(drain(new KeyIterator(s3, "b", "logs/", 10))).containsExactly("logs/2024/a", "logs/2025/b");
    }

    @Test
    void emptyPrefixListsWholeBucketFlat() {
        new InMemoryS3().bucket("b", "x/y/z", "a").install(s3);

        assertThat(drain(new KeyIterator(s3, "b", "", 10))).containsExactly("a", "x/y/z");
    }

    @Test
    void emptyBucketYieldsNothing() {
        new InMemoryS3().bucket("b").install(s3);

        Iterator<String> it = new KeyIterator(s3, "b", "", 10);

        assertThat(it.hasNext()).isFalse();
        assertThatThrownBy(it::next).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void truncatedPageWithoutKeysIsRejected() {
        when(s3.listObjectsV2(any(ListObjectsV2Request.class)))
                .thenReturn(ListObjectsV2Response.builder().isTruncated(true).build());

        Iterator<String> it = new KeyIterator(s3, "b", "p/", 5);

        assertThatThrownBy(it::hasNext)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("s3://b/p/");
    }

    @Test
    void fetchesNextPageOnlyAfterCurrentIsConsumed() {
        new InMemoryS3().bucket("b", "1", "2", "3").install(s3);

        Iterator<String> it = new KeyIterator(s3, "b", "", 2);
        verifyNoInteractions(s3);

        assertThat(it.next()).isEqualTo("1");
        assertThat(it.next()).isEqualTo("2");
        verify(s3, times(1)).listObjectsV2(any(ListObjectsV2Request.class));

        assertThat(it.next()).isEqualTo("3");
        verify(s3, times(2)).listObjectsV2(any(ListObjectsV2Request.class));
    }
}
