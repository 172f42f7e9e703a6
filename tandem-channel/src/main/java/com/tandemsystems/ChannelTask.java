package com.tandemsystems;

/**
 * Body of a process that talks over a channel.
 */
@FunctionalInterface
public interface ChannelTask {

    /**
     * Runs the process.
     *
     * @param channel this process's end of the channel
     * @throws InterruptedException if interrupted while waiting on the channel
     */
    void run(ChannelView channel) throws InterruptedException;
}
