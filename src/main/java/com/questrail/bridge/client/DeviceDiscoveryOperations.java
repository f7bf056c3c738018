package com.questrail.bridge.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.questrail.bridge.api.BridgeClient;
import com.questrail.bridge.model.Device;
import com.questrail.bridge.protocol.BridgeMessageCodec;
import com.questrail.bridge.protocol.MessageKind;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Enumerates devices attached to the bridge host.
 */
public final class DeviceDiscoveryOperations extends OperationSupport
{
    private static final TypeReference<List<Device>> DEVICES = new TypeReference<>() {};

    DeviceDiscoveryOperations(BridgeClient client, BridgeMessageCodec codec)
    {
        super(client, codec, MessageKind.DISCOVERY);
    }

    /**
     * Ask the bridge to rescan. Discovery requests carry no action.
     */
    public CompletableFuture<List<Device>> discover()
    {
        return call("", payload(null), "Failed to discover devices", field("devices", DEVICES));
    }
}
