/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.messaging.connection;

import com.rabbitmq.client.Channel;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Work performed on the shared channel while holding its access lock.
 */
@FunctionalInterface
public interface ChannelCallback<T> {
    T doInChannel(Channel channel) throws IOException, InterruptedException, TimeoutException;
}
