/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.parley.gateway.connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link NetworkMonitor} driven by explicit calls, for hosts that learn about
 * connectivity from somewhere else (a platform hook, an admin endpoint, tests).
 */
public class ManualNetworkMonitor implements NetworkMonitor {

    private static final Logger logger = LoggerFactory.getLogger(ManualNetworkMonitor.class);

    private final ListenerRegistry<NetworkListener> listeners = new ListenerRegistry<>("network");
    private boolean online = true;

    @Override
    public Subscription subscribe(NetworkListener listener) {
        return listeners.add(listener);
    }

    public void goOnline() {
        synchronized (this) {
            if (online) {
                return;
            }
            online = true;
        }
        logger.info("Network reported online");
        listeners.notifyEach(NetworkListener::onOnline);
    }

    public void goOffline() {
        synchronized (this) {
            if (!online) {
                return;
            }
            online = false;
        }
        logger.info("Network reported offline");
        listeners.notifyEach(NetworkListener::onOffline);
    }

    public synchronized boolean isOnline() {
        return online;
    }
}
