/**
 * Player exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.sendspin.exception.SendspinException} - Base exception
 *       for all player errors</li>
 *   <li>{@link com.phillippitts.sendspin.exception.AudioDeviceException} - output device
 *       could not be opened for a stream format</li>
 *   <li>{@link com.phillippitts.sendspin.exception.ProtocolException} - a control message
 *       is missing fields or has wrongly typed values</li>
 *   <li>{@link com.phillippitts.sendspin.exception.ClientIdentityException} - the persisted
 *       client id could not be read</li>
 * </ul>
 *
 * <p>All exceptions are unchecked and support chaining via {@code cause}. Per-item errors
 * (bad frames, late chunks) are handled where they occur; only transport and device
 * failures end a stream or session.
 *
 * @since 1.0
 */
package com.phillippitts.sendspin.exception;
