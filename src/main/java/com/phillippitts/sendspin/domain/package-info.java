/**
 * Immutable domain types shared by the protocol, session and playback layers.
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.sendspin.domain.ConnectionState} - session lifecycle and its
 *       legal transitions</li>
 *   <li>{@link com.phillippitts.sendspin.domain.StreamConfig} - format negotiated by stream/start</li>
 *   <li>{@link com.phillippitts.sendspin.domain.AudioChunk} - timestamped PCM payload</li>
 *   <li>{@link com.phillippitts.sendspin.domain.PlayerState} - snapshot read by the host application</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.sendspin.domain;
