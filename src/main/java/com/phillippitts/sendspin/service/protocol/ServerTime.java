package com.phillippitts.sendspin.service.protocol;

/**
 * Payload of server/time: the echoed client send time plus the controller's receive and
 * send times, all in microseconds.
 */
public record ServerTime(long clientTransmitted, long serverReceived, long serverTransmitted) {
}
