package com.phillippitts.sendspin.service.protocol;

/**
 * Device description sent in client/hello. Any field may be {@code null} and is then omitted.
 */
public record DeviceInfo(String productName, String manufacturer, String softwareVersion) {
}
