package io.partybroker.config;

import com.fasterxml.jackson.core.type.TypeReference;
import io.partybroker.model.PartyInfo;
import io.partybroker.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static roster of the parties this broker knows about: broker URL for inter-party calls and the
 * public key handed to the engine.
 */
public final class PartyRegistry {
    private final Map<String, PartyInfo> parties;

    public PartyRegistry(Collection<PartyInfo> parties) {
        Map<String, PartyInfo> byCode = new LinkedHashMap<>();
        for (PartyInfo party : parties) {
            if (party.code() == null || party.code().isBlank()) {
                throw new IllegalArgumentException("party code must not be blank");
            }
            byCode.put(party.code(), party);
        }
        this.parties = Map.copyOf(byCode);
    }

    public static PartyRegistry load(Path file) {
        if (file == null || !Files.exists(file)) {
            return new PartyRegistry(List.of());
        }
        try {
            List<PartyInfo> rows = Jsons.mapper().readValue(file.toFile(), new TypeReference<List<PartyInfo>>() {
            });
            return new PartyRegistry(rows);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load party registry: " + file, e);
        }
    }

    public String brokerUrlOf(String partyCode) {
        return require(partyCode).brokerUrl();
    }

    public String pubKeyOf(String partyCode) {
        return require(partyCode).pubKey();
    }

    public List<PartyInfo> partyInfoOf(Collection<String> partyCodes) {
        List<PartyInfo> out = new ArrayList<>(partyCodes.size());
        for (String code : partyCodes) {
            out.add(require(code));
        }
        return out;
    }

    public boolean contains(String partyCode) {
        return parties.containsKey(partyCode);
    }

    private PartyInfo require(String partyCode) {
        PartyInfo info = parties.get(partyCode);
        if (info == null) {
            throw new IllegalArgumentException("Unknown party: " + partyCode);
        }
        return info;
    }
}
