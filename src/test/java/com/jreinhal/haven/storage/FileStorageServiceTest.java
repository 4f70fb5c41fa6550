package com.jreinhal.haven.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.jreinhal.haven.exception.ErrorKind;
import com.jreinhal.haven.exception.HavenException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.util.ReflectionTestUtils;

class FileStorageServiceTest {

    @TempDir
    Path uploads;

    private FileStorageService storage;

    @BeforeEach
    void setUp() {
        storage = new FileStorageService();
        ReflectionTestUtils.setField(storage, "uploadDir", uploads.toString());
        ReflectionTestUtils.setField(storage, "maxFileSizeBytes", 1024L);
        ReflectionTestUtils.setField(storage, "publicBaseUrl", "/uploads");
        storage.init();
    }

    @Nested
    @DisplayName("buffer()")
    class Buffer {

        @Test
        void buffersFilesAndSkipsEmptyOnes() {
            List<IncomingFile> buffered = storage.buffer("files", List.of(
                    new MockMultipartFile("files", "photo.png", "image/png", new byte[] {1, 2}),
                    new MockMultipartFile("files", "empty.png", "image/png", new byte[0])));

            assertThat(buffered).singleElement().satisfies(file -> {
                assertThat(file.originalFilename()).isEqualTo("photo.png");
                assertThat(file.size()).isEqualTo(2);
            });
        }

        @Test
        @DisplayName("Should leave the policy check to the case services")
        void doesNotRejectDisallowedType() {
            List<IncomingFile> buffered = storage.buffer("files", List.of(
                    new MockMultipartFile("files", "run.sh", "application/x-sh", new byte[] {1})));

            assertThat(buffered).singleElement().extracting(IncomingFile::contentType).isEqualTo("application/x-sh");
        }

        @Test
        void nullListIsEmpty() {
            assertThat(storage.buffer("files", null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("checkAll()")
    class CheckAll {

        @Test
        void rejectsDisallowedType() {
            assertThatThrownBy(() -> storage.checkAll(List.of(
                    new IncomingFile("files", "photo.png", "image/png", new byte[] {1}),
                    new IncomingFile("files", "run.sh", "application/x-sh", new byte[] {1}))))
                    .hasMessage(FileStorageService.NOT_ALLOWED_MESSAGE)
                    .satisfies(e -> assertThat(((HavenException) e).getKind()).isEqualTo(ErrorKind.INVALID_ARGUMENT));
        }

        @Test
        void rejectsOversizedFile() {
            assertThatThrownBy(() -> storage.checkAll(List.of(
                    new IncomingFile("files", "big.pdf", "application/pdf", new byte[2048]))))
                    .hasMessageStartingWith("File too large");
        }

        @Test
        void acceptsAllowedFilesAndNull() {
            storage.checkAll(List.of(new IncomingFile("files", "a.wav", "audio/wav", new byte[] {1})));
            storage.checkAll(null);
        }
    }

    @Test
    @DisplayName("Should remove a stored file that was never attached")
    void discardRemovesStoredFile() {
        StoredFile stored = storage.store(new IncomingFile("files", "photo.png", "image/png", new byte[] {1}));
        assertThat(Files.exists(uploads.resolve(stored.filename()))).isTrue();

        storage.discard(stored);
        storage.discard(stored);

        assertThat(Files.exists(uploads.resolve(stored.filename()))).isFalse();
    }

    @Test
    @DisplayName("Stored names are generated and never taken from the client")
    void storesUnderGeneratedName() throws Exception {
        StoredFile stored = storage.store(new IncomingFile("files", "../../etc/passwd.PDF", "application/pdf", new byte[] {7}));

        assertThat(stored.filename()).startsWith("files-").endsWith(".pdf").doesNotContain("..");
        assertThat(stored.url()).isEqualTo("/uploads/" + stored.filename());
        assertThat(stored.type()).isEqualTo("document");
        assertThat(Files.readAllBytes(uploads.resolve(stored.filename()))).containsExactly(7);
    }

    @Test
    void unsafeFieldNameFallsBackToFile() {
        assertThat(storage.generateFilename("../x", "a.wav")).startsWith("file-").endsWith(".wav");
        assertThat(FileStorageService.extensionOf("noext")).isEmpty();
        assertThat(FileStorageService.extensionOf("weird.p$p")).isEmpty();
    }

    @Test
    void classifiesAttachmentKinds() {
        assertThat(FileStorageService.classify("image/webp")).isEqualTo("image");
        assertThat(FileStorageService.classify("AUDIO/OGG")).isEqualTo("audio");
        assertThat(FileStorageService.classify("application/msword")).isEqualTo("document");
        assertThat(FileStorageService.classify("text/plain")).isEqualTo("other");
        assertThat(FileStorageService.classify(null)).isEqualTo("other");
    }
}
