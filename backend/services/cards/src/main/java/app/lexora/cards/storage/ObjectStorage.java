package app.lexora.cards.storage;

import java.io.InputStream;
import java.util.Optional;

public interface ObjectStorage {

    void putObject(String key, String contentType, long contentLength, InputStream inputStream);

    Optional<byte[]> getObject(String key);

    void deleteObject(String key);
}
