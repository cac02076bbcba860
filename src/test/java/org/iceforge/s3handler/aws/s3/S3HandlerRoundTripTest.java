package org.iceforge.s3handler.aws.s3;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class S3HandlerRoundTripTest {

    private S3Handler handler;

    @BeforeEach
    void setUp() {
        S3Client s3 = mock(S3Client.class);
        new InMemoryS3().bucket("src").bucket("trg").install(s3);
        handler = new AwsSdkS3Handler(s3);
    }

    @Test
    void writeThenReadReturnsSameText() {
        String text = "line one\nzwei – drei ✓\n";
        handler.writeFile("src", "docs/readme.txt", text);

        assertThat(handler.readFile("src", "docs/readme.txt")).isEqualTo(text);
    }

    @Test
    void writeThenReadWithSameCharset() {
        handler.writeFile("src", "latin.txt", "àéî", StandardCharsets.ISO_8859_1);

        assertThat(handler.readBytes("src", "latin.txt")).hasSize(3);
        assertThat(handler.readFile("src", "latin.txt", StandardCharsets.ISO_8859_1)).isEqualTo("àéî");
    }

    @Test
    void copyThenReadMatchesSource() {
        handler.writeBytes("src", "a/blob", new byte[]{1, 2, 3, 4});

        handler.copyFile("src", "a/blob", "trg", "b/blob-copy");

        assertThat(handler.readBytes("trg", "b/blob-copy")).isEqualTo(handler.readBytes("src", "a/blob"));
    }

    @Test
    void deletedObjectCannotBeRead() {
        handler.writeFile("src", "gone", "x");

        handler.deleteFile("src", "gone");

        assertThatThrownBy(() -> handler.readFile("src", "gone")).isInstanceOf(NoSuchKeyException.class);
    }

    @Test
    void listBucketsReturnsAllNames() {
        assertThat(handler.listBuckets()).containsExactly("src", "trg");
    }

    @Test
    void streamKeysSeesWrittenObjects() {
        handler.writeFile("src", "p/1", "a");
        handler.writeFile("src", "p/2", "b");
        handler.writeFile("src", "q/3", "c");

        assertThat(handler.streamKeys("src", "p/")).containsExactly("p/1", "p/2");
    }
}
