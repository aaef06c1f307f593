package com.phillippitts.sendspin.service.protocol;

import com.phillippitts.sendspin.domain.AudioChunk;
import com.phillippitts.sendspin.domain.StreamConfig;
import com.phillippitts.sendspin.exception.ProtocolException;
import com.phillippitts.sendspin.util.LogPreview;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

/**
 * Encodes and decodes Sendspin control messages and binary audio frames.
 *
 * <p>Control messages are JSON envelopes {@code {"type": "...", "payload": {...}}}. Binary
 * frames carry a one-byte type tag, an 8-byte big-endian microsecond timestamp and the raw
 * payload.
 *
 * <p>Decoders never throw: malformed input yields {@link Optional#empty()} and a log line.
 *
 * <p>Thread-safe: All methods are static and stateless.
 *
 * @since 1.0
 */
public final class SendspinProtocol {

    private static final Logger LOG = LogManager.getLogger(SendspinProtocol.class);

    public static final int PROTOCOL_VERSION = 1;
    public static final int DEFAULT_PORT = 8927;
    public static final String DEFAULT_PATH = "/sendspin";
    public static final String SERVICE_TYPE = "_sendspin._tcp.";
    public static final String TXT_PATH_KEY = "path";

    public static final String ROLE_PLAYER = "player@v1";
    public static final String CODEC_PCM = "pcm";
    public static final String CLIENT_STATE_SYNCHRONIZED = "synchronized";
    public static final String CLIENT_STATE_ERROR = "error";

    /** Binary frame type tags (byte 0). */
    public static final int BINARY_AUDIO = 4;
    public static final int BINARY_ARTWORK_FIRST = 8;
    public static final int BINARY_ARTWORK_LAST = 11;
    public static final int BINARY_VISUALIZER = 16;

    /** Tag byte plus 8-byte timestamp. */
    public static final int BINARY_HEADER_SIZE = 9;

    public static final SupportedFormat PCM_48K_STEREO_16 = new SupportedFormat(CODEC_PCM, 2, 48_000, 16);
    public static final SupportedFormat PCM_44K_STEREO_16 = new SupportedFormat(CODEC_PCM, 2, 44_100, 16);

    /** Formats advertised in client/hello, most preferred first. */
    public static final List<SupportedFormat> DEFAULT_FORMATS = List.of(PCM_48K_STEREO_16, PCM_44K_STEREO_16);

    public static final List<String> SUPPORTED_COMMANDS = List.of(PlayerCommand.VOLUME, PlayerCommand.MUTE);

    /** Cap on inbound JSON text; larger messages are dropped before parsing. */
    private static final int MAX_JSON_SIZE = 1_048_576;

    private static final int LOG_PREVIEW_CHARS = 200;

    private SendspinProtocol() {
        // Utility class - prevent instantiation
    }

    /**
     * Builds client/hello.
     *
     * @param clientId persistent client id
     * @param name display name shown by the controller
     * @param deviceInfo device description, may be null
     * @param formats formats the player accepts, most preferred first
     * @param bufferCapacity ring buffer capacity in bytes
     * @return serialized message
     */
    public static String clientHello(String clientId, String name, DeviceInfo deviceInfo,
                                     List<SupportedFormat> formats, int bufferCapacity) {
        JSONArray supportedFormats = new JSONArray();
        for (SupportedFormat f : formats) {
            supportedFormats.put(new JSONObject()
                    .put("codec", f.codec())
                    .put("channels", f.channels())
                    .put("sample_rate", f.sampleRate())
                    .put("bit_depth", f.bitDepth()));
        }
        JSONObject playerSupport = new JSONObject()
                .put("supported_formats", supportedFormats)
                .put("buffer_capacity", bufferCapacity)
                .put("supported_commands", new JSONArray(SUPPORTED_COMMANDS));

        JSONObject payload = new JSONObject()
                .put("client_id", clientId)
                .put("name", name)
                .put("version", PROTOCOL_VERSION)
                .put("supported_roles", new JSONArray(List.of(ROLE_PLAYER)))
                .put("player_support", playerSupport);
        if (deviceInfo != null) {
            // put(key, null) removes the key, so absent fields are simply omitted
            payload.put("device_info", new JSONObject()
                    .put("product_name", deviceInfo.productName())
                    .put("manufacturer", deviceInfo.manufacturer())
                    .put("software_version", deviceInfo.softwareVersion()));
        }
        return envelope(MessageType.CLIENT_HELLO, payload);
    }

    /** Builds client/time carrying the local send time in microseconds. */
    public static String clientTime(long clientTransmittedMicros) {
        return envelope(MessageType.CLIENT_TIME,
                new JSONObject().put("client_transmitted", clientTransmittedMicros));
    }

    /**
     * Builds client/state reporting the player's volume and mute state.
     *
     * @param state "synchronized" or "error"
     * @param volume volume 0-100
     * @param muted mute flag
     * @return serialized message
     */
    public static String clientState(String state, int volume, boolean muted) {
        JSONObject player = new JSONObject()
                .put("state", state)
                .put("volume", volume)
                .put("muted", muted);
        return envelope(MessageType.CLIENT_STATE, new JSONObject().put("player", player));
    }

    /** Builds stream/request-format asking the controller to switch to {@code format}. */
    public static String streamRequestFormat(SupportedFormat format) {
        JSONObject player = new JSONObject()
                .put("codec", format.codec())
                .put("channels", format.channels())
                .put("sample_rate", format.sampleRate())
                .put("bit_depth", format.bitDepth());
        return envelope(MessageType.STREAM_REQUEST_FORMAT, new JSONObject().put("player", player));
    }

    /**
     * Builds a binary audio frame. Used by controllers and tests; the player only decodes.
     */
    public static byte[] audioFrame(long timestampMicros, byte[] pcm) {
        ByteBuffer buf = ByteBuffer.allocate(BINARY_HEADER_SIZE + pcm.length).order(ByteOrder.BIG_ENDIAN);
        buf.put((byte) BINARY_AUDIO).putLong(timestampMicros).put(pcm);
        return buf.array();
    }

    private static String envelope(MessageType type, JSONObject payload) {
        return new JSONObject()
                .put("type", type.wireName())
                .put("payload", payload)
                .toString();
    }

    /**
     * Parses the envelope of an inbound text frame.
     *
     * @param json raw text frame
     * @return the envelope, or empty when the text is not a JSON object with a string type
     */
    public static Optional<SendspinMessage> parseMessage(String json) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        if (json.length() > MAX_JSON_SIZE) {
            LOG.warn("Dropping text frame of {} chars (cap {})", json.length(), MAX_JSON_SIZE);
            return Optional.empty();
        }
        try {
            JSONObject obj = new JSONObject(json);
            Object type = obj.opt("type");
            if (!(type instanceof String typeName) || typeName.isBlank()) {
                LOG.warn("Dropping message without type: {}", LogPreview.truncate(json, LOG_PREVIEW_CHARS));
                return Optional.empty();
            }
            JSONObject payload = obj.optJSONObject("payload");
            return Optional.of(new SendspinMessage(typeName, payload == null ? new JSONObject() : payload));
        } catch (JSONException e) {
            LOG.warn("Dropping malformed JSON message: {}", LogPreview.truncate(json, LOG_PREVIEW_CHARS), e);
            return Optional.empty();
        }
    }

    public static Optional<ServerHello> parseServerHello(JSONObject payload) {
        return decode(MessageType.SERVER_HELLO, payload, p -> new ServerHello(
                requireString(MessageType.SERVER_HELLO, p, "server_id"),
                requireString(MessageType.SERVER_HELLO, p, "name"),
                p.optInt("version", PROTOCOL_VERSION),
                stringList(p.optJSONArray("active_roles")),
                optString(p, "connection_reason")));
    }

    public static Optional<ServerTime> parseServerTime(JSONObject payload) {
        return decode(MessageType.SERVER_TIME, payload, p -> new ServerTime(
                requireLong(MessageType.SERVER_TIME, p, "client_transmitted"),
                requireLong(MessageType.SERVER_TIME, p, "server_received"),
                requireLong(MessageType.SERVER_TIME, p, "server_transmitted")));
    }

    /**
     * Decodes stream/start into a stream configuration.
     *
     * <p>An undecodable {@code codec_header} is logged and dropped; the stream itself is
     * still accepted.
     */
    public static Optional<StreamConfig> parseStreamStart(JSONObject payload) {
        MessageType type = MessageType.STREAM_START;
        return decode(type, payload, p -> {
            JSONObject player = requireObject(type, p, "player");
            String codec = requireString(type, player, "codec");
            int sampleRate = requireInt(type, player, "sample_rate");
            int channels = requireInt(type, player, "channels");
            int bitDepth = requireInt(type, player, "bit_depth");
            byte[] header = decodeCodecHeader(optString(player, "codec_header"));
            try {
                return new StreamConfig(codec, sampleRate, channels, bitDepth, header);
            } catch (IllegalArgumentException e) {
                throw new ProtocolException(type.wireName(), e.getMessage(), e);
            }
        });
    }

    public static Optional<PlayerCommand> parseServerCommand(JSONObject payload) {
        MessageType type = MessageType.SERVER_COMMAND;
        return decode(type, payload, p -> {
            JSONObject player = requireObject(type, p, "player");
            String command = requireString(type, player, "command");
            Integer volume = player.opt("volume") instanceof Number n ? n.intValue() : null;
            Boolean mute = player.opt("mute") instanceof Boolean b ? b : null;
            return new PlayerCommand(command, volume, mute);
        });
    }

    /** Decodes the roles list of stream/clear or stream/end; a missing list addresses no role. */
    public static Optional<StreamRoles> parseStreamRoles(MessageType type, JSONObject payload) {
        return decode(type, payload, p -> {
            if (!p.has("roles") || p.isNull("roles")) {
                return new StreamRoles(null);
            }
            JSONArray roles = p.optJSONArray("roles");
            if (roles == null) {
                throw new ProtocolException(type.wireName(), "roles is not an array");
            }
            return new StreamRoles(stringList(roles));
        });
    }

    /**
     * Decodes server/state. Only the player role is implemented, so the payload is kept
     * opaque for logging.
     */
    public static Optional<JSONObject> parseServerState(JSONObject payload) {
        return Optional.ofNullable(payload);
    }

    /**
     * Decodes a binary audio frame.
     *
     * @param frame complete binary frame
     * @return the chunk, or empty when the frame is shorter than the header or not audio
     */
    public static Optional<AudioChunk> parseBinaryAudio(byte[] frame) {
        if (frame == null || frame.length < BINARY_HEADER_SIZE) {
            return Optional.empty();
        }
        return parseBinaryAudio(ByteBuffer.wrap(frame));
    }

    /**
     * Decodes a binary audio frame from the buffer's remaining bytes without moving its
     * position.
     */
    public static Optional<AudioChunk> parseBinaryAudio(ByteBuffer frame) {
        if (frame == null || frame.remaining() < BINARY_HEADER_SIZE) {
            return Optional.empty();
        }
        ByteBuffer buf = frame.duplicate().order(ByteOrder.BIG_ENDIAN);
        int tag = buf.get() & 0xFF;
        if (tag != BINARY_AUDIO) {
            return Optional.empty();
        }
        long timestamp = buf.getLong();
        byte[] data = new byte[buf.remaining()];
        buf.get(data);
        return Optional.of(new AudioChunk(timestamp, data));
    }

    /** Type tag of a binary frame, or -1 for an empty frame. */
    public static int binaryType(ByteBuffer frame) {
        return frame == null || !frame.hasRemaining() ? -1 : frame.get(frame.position()) & 0xFF;
    }

    @FunctionalInterface
    private interface PayloadDecoder<T> {
        T decode(JSONObject payload);
    }

    private static <T> Optional<T> decode(MessageType type, JSONObject payload, PayloadDecoder<T> decoder) {
        if (payload == null) {
            LOG.warn("Dropping {} without payload", type.wireName());
            return Optional.empty();
        }
        try {
            return Optional.of(decoder.decode(payload));
        } catch (ProtocolException e) {
            LOG.warn("Dropping message: {}", e.getMessage());
            return Optional.empty();
        } catch (JSONException e) {
            LOG.warn("Dropping malformed {}: {}", type.wireName(), e.getMessage());
            return Optional.empty();
        }
    }

    private static byte[] decodeCodecHeader(String encoded) {
        if (encoded == null || encoded.isEmpty()) {
            return null;
        }
        try {
            return Base64.getMimeDecoder().decode(encoded);
        } catch (IllegalArgumentException e) {
            LOG.warn("Ignoring undecodable codec_header ({} chars): {}", encoded.length(), e.getMessage());
            return null;
        }
    }

    private static JSONObject requireObject(MessageType type, JSONObject obj, String key) {
        JSONObject value = obj.optJSONObject(key);
        if (value == null) {
            throw new ProtocolException(type.wireName(), "missing object '" + key + "'");
        }
        return value;
    }

    private static String requireString(MessageType type, JSONObject obj, String key) {
        if (!(obj.opt(key) instanceof String value)) {
            throw new ProtocolException(type.wireName(), "missing string '" + key + "'");
        }
        return value;
    }

    private static long requireLong(MessageType type, JSONObject obj, String key) {
        if (!(obj.opt(key) instanceof Number value)) {
            throw new ProtocolException(type.wireName(), "missing number '" + key + "'");
        }
        return value.longValue();
    }

    private static int requireInt(MessageType type, JSONObject obj, String key) {
        if (!(obj.opt(key) instanceof Number value)) {
            throw new ProtocolException(type.wireName(), "missing number '" + key + "'");
        }
        return value.intValue();
    }

    private static String optString(JSONObject obj, String key) {
        return obj.opt(key) instanceof String s ? s : null;
    }

    private static List<String> stringList(JSONArray array) {
        List<String> out = new ArrayList<>();
        if (array == null) {
            return out;
        }
        for (int i = 0; i < array.length(); i++) {
            if (array.opt(i) instanceof String s) {
                out.add(s);
            }
        }
        return out;
    }
}
