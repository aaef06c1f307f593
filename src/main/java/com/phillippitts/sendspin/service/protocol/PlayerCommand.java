package com.phillippitts.sendspin.service.protocol;

/**
 * Player part of server/command.
 *
 * @param command "volume" or "mute"; other values are ignored by the session
 * @param volume new volume 0-100 when {@code command} is "volume", otherwise usually null
 * @param mute new mute flag when {@code command} is "mute", otherwise usually null
 */
public record PlayerCommand(String command, Integer volume, Boolean mute) {

    public static final String VOLUME = "volume";
    public static final String MUTE = "mute";
}
