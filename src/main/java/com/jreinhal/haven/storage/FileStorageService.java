package com.jreinhal.haven.storage;

import com.jreinhal.haven.exception.HavenException;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

/**
 * Local-disk upload store.
 *
 * Controllers only buffer uploads. The case services run {@link #checkAll} once the target
 * report is known to be writable, then store. Stored names are generated; the client
 * filename never reaches the disk path.
 */
@Service
public class FileStorageService {
    private static final Logger log = LoggerFactory.getLogger(FileStorageService.class);

    static final Set<String> IMAGE_TYPES = Set.of("image/jpeg", "image/jpg", "image/png", "image/gif", "image/webp");
    static final Set<String> AUDIO_TYPES = Set.of("audio/mpeg", "audio/mp3", "audio/wav", "audio/ogg", "audio/webm");
    static final Set<String> DOCUMENT_TYPES = Set.of(
            "application/pdf",
            "application/msword",
            "application/vnd.openxmlformats-officedocument.wordprocessingml.document");
    public static final String NOT_ALLOWED_MESSAGE = "File type not allowed. Allowed types: images (jpg, png, gif, webp), "
            + "audio (mp3, wav, ogg, webm), documents (pdf, doc, docx)";
    private static final Pattern SAFE_EXTENSION = Pattern.compile("^\\.[a-z0-9]{1,8}$");
    private static final Pattern SAFE_FIELD = Pattern.compile("^[a-zA-Z0-9_]{1,32}$");

    private final SecureRandom random = new SecureRandom();

    @Value("${app.storage.upload-dir:./uploads}")
    private String uploadDir;

    @Value("${app.storage.max-file-size-bytes:10485760}")
    private long maxFileSizeBytes;

    @Value("${app.storage.public-base-url:/uploads}")
    private String publicBaseUrl;

    private Path root;

    @PostConstruct
    public void init() {
        this.root = Paths.get(uploadDir).toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.root);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create upload directory " + this.root, e);
        }
        log.info("File storage initialised (dir={}, maxBytes={})", this.root, maxFileSizeBytes);
    }

    /**
     * Buffer multipart uploads, skipping empty parts. No policy check happens here.
     */
    public List<IncomingFile> buffer(String fieldName, List<MultipartFile> files) {
        List<IncomingFile> accepted = new ArrayList<>();
        if (files == null) {
            return accepted;
        }
        for (MultipartFile file : files) {
            if (file == null || file.isEmpty()) {
                continue;
            }
            try {
                accepted.add(new IncomingFile(fieldName, file.getOriginalFilename(), file.getContentType(), file.getBytes()));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read upload " + file.getOriginalFilename(), e);
            }
        }
        return accepted;
    }

    public void checkPolicy(String contentType, long size) {
        if (!isAllowed(contentType)) {
            throw HavenException.invalidArgument(NOT_ALLOWED_MESSAGE);
        }
        if (size > maxFileSizeBytes) {
            throw HavenException.invalidArgument("File too large. Maximum size is " + (maxFileSizeBytes / (1024 * 1024)) + " MB");
        }
    }

    /**
     * Fails with INVALID_ARGUMENT on the first out-of-policy file, before anything is written.
     */
    public void checkAll(List<IncomingFile> files) {
        if (files == null) {
            return;
        }
        for (IncomingFile file : files) {
            checkPolicy(file.contentType(), file.size());
        }
    }

    public StoredFile store(IncomingFile file) {
        checkPolicy(file.contentType(), file.size());
        String filename = generateFilename(file.fieldName(), file.originalFilename());
        Path target = root.resolve(filename).normalize();
        if (!target.startsWith(root)) {
            throw HavenException.invalidArgument("Invalid file name");
        }
        try {
            Files.write(target, file.data(), StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to store upload " + filename, e);
        }
        log.debug("Stored upload {} ({} bytes, {})", filename, file.size(), file.contentType());
        return new StoredFile(publicBaseUrl + "/" + filename, classify(file.contentType()), filename, file.contentType(), file.size());
    }

    /**
     * Removes a file written by {@link #store} whose owning record was never saved.
     */
    public void discard(StoredFile stored) {
        if (stored == null || stored.filename() == null) {
            return;
        }
        Path target = root.resolve(stored.filename()).normalize();
        if (!target.startsWith(root)) {
            return;
        }
        try {
            Files.deleteIfExists(target);
        } catch (IOException e) {
            log.warn("Could not remove orphaned upload {}: {}", stored.filename(), e.getMessage());
        }
    }

    public Path getRoot() {
        return root;
    }

    public static boolean isAllowed(String contentType) {
        if (contentType == null) {
            return false;
        }
        String normalized = contentType.toLowerCase(Locale.ROOT);
        return IMAGE_TYPES.contains(normalized) || AUDIO_TYPES.contains(normalized) || DOCUMENT_TYPES.contains(normalized);
    }

    /**
     * Attachment kind reported on a report: image, audio, document or other.
     */
    public static String classify(String contentType) {
        if (contentType == null) {
            return "other";
        }
        String normalized = contentType.toLowerCase(Locale.ROOT);
        if (normalized.startsWith("image/")) {
            return "image";
        }
        if (normalized.startsWith("audio/")) {
            return "audio";
        }
        if (DOCUMENT_TYPES.contains(normalized)) {
            return "document";
        }
        return "other";
    }

    String generateFilename(String fieldName, String originalFilename) {
        String field = fieldName != null && SAFE_FIELD.matcher(fieldName).matches() ? fieldName : "file";
        long suffix = Math.floorMod(random.nextLong(), 1_000_000_000L);
        return field + "-" + System.currentTimeMillis() + "-" + suffix + extensionOf(originalFilename);
    }

    static String extensionOf(String originalFilename) {
        if (originalFilename == null) {
            return "";
        }
        int dot = originalFilename.lastIndexOf('.');
        if (dot < 0) {
            return "";
        }
        String ext = originalFilename.substring(dot).toLowerCase(Locale.ROOT);
        return SAFE_EXTENSION.matcher(ext).matches() ? ext : "";
    }
}
