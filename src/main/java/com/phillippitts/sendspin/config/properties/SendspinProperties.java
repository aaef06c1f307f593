package com.phillippitts.sendspin.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

/**
 * Typed properties for the player endpoint, its identity and its discovery record.
 */
@Validated
@ConfigurationProperties(prefix = "sendspin")
public class SendspinProperties {

    /** Port the WebSocket endpoint listens on and that is advertised over mDNS. */
    @Min(1)
    @Max(65_535)
    private final int port;

    /** WebSocket path, also published as the {@code path} TXT record. */
    @NotBlank
    private final String path;

    /** Name shown by the controller. */
    @NotBlank
    private final String deviceName;

    /** Ring buffer capacity in bytes, advertised in client/hello. */
    @Min(65_536)
    @Max(67_108_864)
    private final int bufferCapacity;

    /** File holding the persistent client id. */
    private final Path clientIdFile;

    private final String productName;
    private final String manufacturer;
    private final String softwareVersion;

    /** Whether the player registers itself via mDNS on startup. */
    private final boolean discoveryEnabled;

    /** Optional local address to bind mDNS to; all interfaces' default when blank. */
    private final String mdnsAddress;

    @ConstructorBinding
    public SendspinProperties(@NotNull Integer port,
                              String path,
                              String deviceName,
                              @NotNull Integer bufferCapacity,
                              String clientIdFile,
                              String productName,
                              String manufacturer,
                              String softwareVersion,
                              Boolean discoveryEnabled,
                              String mdnsAddress) {
        this.port = port;
        this.path = blankToNull(path) == null ? "/sendspin" : path;
        this.deviceName = blankToNull(deviceName) == null ? "Sendspin Java Player" : deviceName;
        this.bufferCapacity = bufferCapacity;
        this.clientIdFile = blankToNull(clientIdFile) == null
                ? Path.of(System.getProperty("user.home"), ".sendspin", "client-id")
                : Path.of(clientIdFile);
        this.productName = blankToNull(productName) == null
                ? "Java " + System.getProperty("java.version") : productName;
        this.manufacturer = blankToNull(manufacturer) == null ? System.getProperty("os.name") : manufacturer;
        this.softwareVersion = blankToNull(softwareVersion);
        this.discoveryEnabled = discoveryEnabled == null || discoveryEnabled;
        this.mdnsAddress = blankToNull(mdnsAddress);
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s;
    }

    public int getPort() { return port; }
    public String getPath() { return path; }
    public String getDeviceName() { return deviceName; }
    public int getBufferCapacity() { return bufferCapacity; }
    public Path getClientIdFile() { return clientIdFile; }
    public String getProductName() { return productName; }
    public String getManufacturer() { return manufacturer; }
    public String getSoftwareVersion() { return softwareVersion; }
    public boolean isDiscoveryEnabled() { return discoveryEnabled; }
    public String getMdnsAddress() { return mdnsAddress; }
}
