package com.phillippitts.sendspin.service.session;

import com.phillippitts.sendspin.service.protocol.DeviceInfo;
import com.phillippitts.sendspin.service.protocol.SupportedFormat;

import java.util.List;
import java.util.Objects;

/**
 * What the player announces about itself in client/hello.
 *
 * @param clientId persistent client id
 * @param name display name
 * @param deviceInfo device description, may be null
 * @param formats supported formats, most preferred first
 * @param bufferCapacity ring buffer capacity in bytes
 */
public record ClientDescriptor(String clientId, String name, DeviceInfo deviceInfo,
                               List<SupportedFormat> formats, int bufferCapacity) {

    public ClientDescriptor {
        Objects.requireNonNull(clientId, "clientId must not be null");
        Objects.requireNonNull(name, "name must not be null");
        formats = List.copyOf(formats);
        if (formats.isEmpty()) {
            throw new IllegalArgumentException("At least one supported format is required");
        }
    }

    /** The format requested when the controller picks one the device cannot open. */
    public SupportedFormat preferredFormat() {
        return formats.get(0);
    }
}
