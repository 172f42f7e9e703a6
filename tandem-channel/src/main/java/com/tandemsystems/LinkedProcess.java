package com.tandemsystems;

/**
 * A process spawned together with a channel to it.
 *
 * @param pid the spawned process
 * @param channel the spawner's end of the channel
 */
public record LinkedProcess(ProcessId pid, ChannelView channel) {
}
