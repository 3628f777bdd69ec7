/* 
 * Copyright (C) 2025 Scopie developers
 *
 * This File is part of Scopie
 *
 * Scopie is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * Scopie is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with Scopie.  If not, see <http://www.gnu.org/licenses/>.
 */
package scopie.devices;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scopie.utils.PushStream;
import scopie.utils.SimplePushStream;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Live devices of one kind, owned by the application.
 * Every change is published as a snapshot of the device list.
 * @param <D> type of device
 */
public class DeviceRegistry<D> {
    public final static Logger logger = LoggerFactory.getLogger(DeviceRegistry.class);
    private final List<D> devices = new ArrayList<>();
    private final SimplePushStream<List<D>> changes = new SimplePushStream<>();

    /**
     * @return false if {@param device} was already registered
     */
    public synchronized boolean register(D device) {
        if (device==null) throw new IllegalArgumentException("Cannot register null device");
        if (devices.contains(device)) return false;
        devices.add(device);
        logger.debug("device registered: {}", device);
        changes.push(getDevices());
        return true;
    }

    /**
     * @return false if {@param device} was not registered
     */
    public synchronized boolean unregister(D device) {
        if (!devices.remove(device)) return false;
        logger.debug("device unregistered: {}", device);
        changes.push(getDevices());
        return true;
    }

    /**
     * @return snapshot of registered devices, in registration order
     */
    public synchronized List<D> getDevices() {
        return Collections.unmodifiableList(new ArrayList<>(devices));
    }

    public PushStream<List<D>> getChanges() {
        return changes;
    }
}
