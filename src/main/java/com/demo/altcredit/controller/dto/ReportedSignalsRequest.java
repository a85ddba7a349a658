package com.demo.altcredit.controller.dto;

import com.demo.altcredit.service.collect.device.NetworkSnapshot;
import com.demo.altcredit.service.collect.device.PermissionStatus;
import com.demo.altcredit.service.collect.device.RawPosition;
import com.demo.altcredit.service.collect.device.ReportedSignals;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

/** Device snapshot as the client posts it. Omitted parts stay null and make that section unavailable. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReportedSignalsRequest {
    public Map<String, Object> device;     // keys from DeviceAttributes
    public Network network;
    public List<String> storageKeys;
    public String cookies;
    public PermissionStatus locationPermission;
    public Position position;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Network {
        public String type;                // wifi | cellular | ethernet | none | unknown
        public boolean connected;
        public boolean expensive;
        public Integer signalStrength;
        public Double wifiPercentage;
        public Double cellularPercentage;
        public Integer stabilityScore;     // 0..100
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Position {
        public double latitude;
        public double longitude;
        public Double accuracy;            // metres
        public long timestamp;             // epoch ms
        public boolean mocked;
    }

    public ReportedSignals toSignals() {
        NetworkSnapshot net = network == null ? null : new NetworkSnapshot(network.type, network.connected,
                network.expensive, network.signalStrength, network.wifiPercentage,
                network.cellularPercentage, network.stabilityScore);
        RawPosition pos = position == null ? null : new RawPosition(position.latitude, position.longitude,
                position.accuracy, position.timestamp, position.mocked);
        return new ReportedSignals(device, net, storageKeys, cookies, locationPermission, pos);
    }
}
