package org.assetlink.service.resolution;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Semantic fields located in heterogeneous rows, with the header spellings accepted for each.
 * Alias order carries no priority; the first matching column of the row wins.
 */
public enum FieldType {

    MAC(FieldNormalizer::normalizeMac,
            "mac", "macaddress", "physicaladdress", "ethernet", "hwaddress", "hardwareaddress", "physical"),
    HOSTNAME(FieldNormalizer::normalizeHostname,
            "hostname", "host", "computername", "name", "assetname", "devicename", "systemname", "computer",
            "device", "system"),
    IP(FieldNormalizer::normalizeIp,
            "ip", "ipaddress", "ipv4", "address", "ipv4address", "internetaddress", "ipaddr"),
    GENERIC_ID(FieldNormalizer::normalizeGenericId,
            "id", "assetid", "serial", "serialnumber", "tag", "assettag"),
    MANUFACTURER(FieldNormalizer::normalizeManufacturer,
            "manufacturer", "mfg", "vendor", "make", "devicevendor", "hardwarevendor", "manuf");

    private final Function<String, Optional<String>> normalizer;
    private final List<String> aliases;

    FieldType(Function<String, Optional<String>> normalizer, String... aliases) {
        this.normalizer = normalizer;
        this.aliases = List.of(aliases);
    }

    public List<String> aliases() {
        return aliases;
    }

    public Optional<String> normalize(String raw) {
        return normalizer.apply(raw);
    }
}
