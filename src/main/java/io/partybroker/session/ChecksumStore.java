package io.partybroker.session;

import io.partybroker.error.BrokerException;
import io.partybroker.error.ErrorCode;
import io.partybroker.model.Checksum;
import io.partybroker.model.CompareResult;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Checksums of one session: the ones this broker computed for each data party, and the ones the
 * other parties reported for themselves.
 */
public final class ChecksumStore {
    private final Map<String, Checksum> local = new ConcurrentHashMap<>();
    private final Map<String, Checksum> remote = new ConcurrentHashMap<>();

    public void saveLocal(String party, Checksum checksum) {
        local.put(party, checksum);
    }

    public void saveLocal(Map<String, Checksum> checksums) {
        local.putAll(checksums);
    }

    public void saveRemote(String party, Checksum checksum) {
        if (checksum == null) {
            throw new BrokerException(ErrorCode.INVALID_STATE, "party " + party + " returned no checksum");
        }
        remote.put(party, checksum);
    }

    public Optional<Checksum> local(String party) {
        return Optional.ofNullable(local.get(party));
    }

    public Optional<Checksum> remote(String party) {
        return Optional.ofNullable(remote.get(party));
    }

    public CompareResult compareChecksumFor(String party) {
        Checksum mine = local.get(party);
        if (mine == null) {
            throw new BrokerException(ErrorCode.INVALID_STATE, "no local checksum for party " + party);
        }
        Checksum theirs = remote.get(party);
        if (theirs == null) {
            throw new BrokerException(ErrorCode.INVALID_STATE, "no checksum received from party " + party);
        }
        return mine.compareTo(theirs);
    }

    public void clearLocal() {
        local.clear();
    }
}
