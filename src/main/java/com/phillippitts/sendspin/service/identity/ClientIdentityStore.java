package com.phillippitts.sendspin.service.identity;

import com.phillippitts.sendspin.config.properties.SendspinProperties;
import com.phillippitts.sendspin.exception.ClientIdentityException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

/**
 * Persistent client id sent in client/hello.
 *
 * <p>The id is a random UUID generated on first use and stored in a file, so the controller
 * recognizes the player across restarts. If the file cannot be written the generated id is
 * used for the lifetime of the process. An existing file that cannot be read is an error.
 */
@Component
public class ClientIdentityStore {

    private static final Logger LOG = LogManager.getLogger(ClientIdentityStore.class);

    private final Path idFile;
    private volatile String clientId;

    @Autowired
    public ClientIdentityStore(SendspinProperties props) {
        this(props.getClientIdFile());
    }

    // Package-private for tests
    ClientIdentityStore(Path idFile) {
        this.idFile = idFile;
    }

    /**
     * Returns the stored id, creating and persisting one on first call.
     *
     * @throws ClientIdentityException if the id file exists but cannot be read
     */
    public String getClientId() {
        String id = clientId;
        if (id != null) {
            return id;
        }
        synchronized (this) {
            if (clientId == null) {
                clientId = loadOrCreate();
            }
            return clientId;
        }
    }

    private String loadOrCreate() {
        String stored = read();
        if (stored != null) {
            LOG.debug("Loaded client id from {}", idFile);
            return stored;
        }
        String generated = UUID.randomUUID().toString();
        try {
            write(generated);
            LOG.info("Generated client id {} stored in {}", generated, idFile);
        } catch (ClientIdentityException e) {
            LOG.warn("{}; id {} is used for this run only", e.getMessage(), generated);
        }
        return generated;
    }

    private String read() {
        if (!Files.isRegularFile(idFile)) {
            return null;
        }
        try {
            String content = Files.readString(idFile, StandardCharsets.UTF_8).trim();
            return content.isEmpty() ? null : content;
        } catch (IOException e) {
            throw new ClientIdentityException("Client id file not readable", idFile, e);
        }
    }

    private void write(String id) {
        try {
            Path parent = idFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(idFile, id + System.lineSeparator(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ClientIdentityException("Client id file not writable", idFile, e);
        }
    }
}
