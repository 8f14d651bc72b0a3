package com.techStack.geoAccess.util.firebase;

import com.techStack.geoAccess.models.geo.GeoRecord;
import com.techStack.geoAccess.models.geo.ThreatLevel;

import java.util.HashMap;
import java.util.Map;

import static com.techStack.geoAccess.util.firebase.FirestoreFields.*;

public final class GeoDocumentMapper {

    private GeoDocumentMapper() {}

    public static Map<String, Object> toMap(GeoRecord record) {
        Map<String, Object> data = new HashMap<>();
        data.put("ipAddress", record.getIpAddress());
        data.put("countryCode", record.getCountryCode());
        data.put("countryName", record.getCountryName());
        data.put("region", record.getRegion());
        data.put("city", record.getCity());
        data.put("isp", record.getIsp());
        data.put("organization", record.getOrganization());
        data.put("latitude", record.getLatitude());
        data.put("longitude", record.getLongitude());
        data.put("proxy", record.isProxy());
        data.put("vpn", record.isVpn());
        data.put("tor", record.isTor());
        data.put("hosting", record.isHosting());
        data.put("threatLevel", enumName(record.getThreatLevel()));
        putTimestamp(data, "firstSeen", record.getFirstSeen());
        putTimestamp(data, "lastSeen", record.getLastSeen());
        data.put("accessCount", record.getAccessCount());
        return data;
    }

    public static GeoRecord fromMap(Map<String, Object> data) {
        if (data == null || data.isEmpty()) {
            return null;
        }
        return GeoRecord.builder()
                .ipAddress(getString(data, "ipAddress"))
                .countryCode(getString(data, "countryCode"))
                .countryName(getString(data, "countryName"))
                .region(getString(data, "region"))
                .city(getString(data, "city"))
                .isp(getString(data, "isp"))
                .organization(getString(data, "organization"))
                .latitude(getDouble(data, "latitude"))
                .longitude(getDouble(data, "longitude"))
                .proxy(getBoolean(data, "proxy"))
                .vpn(getBoolean(data, "vpn"))
                .tor(getBoolean(data, "tor"))
                .hosting(getBoolean(data, "hosting"))
                .threatLevel(getEnum(data, "threatLevel", ThreatLevel.class))
                .firstSeen(getInstant(data, "firstSeen"))
                .lastSeen(getInstant(data, "lastSeen"))
                .accessCount(getLong(data, "accessCount"))
                .build();
    }
}
