/**
 * Sendspin wire format: JSON control envelopes and binary audio frames.
 *
 * <p>{@link com.phillippitts.sendspin.service.protocol.SendspinProtocol} is the only entry
 * point; the records in this package are its decoded payloads.
 */
package com.phillippitts.sendspin.service.protocol;
