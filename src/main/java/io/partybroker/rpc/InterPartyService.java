package io.partybroker.rpc;

import io.partybroker.model.Checksum;
import io.partybroker.model.ColumnControl;
import io.partybroker.model.CompareResult;
import io.partybroker.model.Status;
import io.partybroker.model.StatusCode;
import io.partybroker.model.TableMeta;
import io.partybroker.session.Session;
import io.partybroker.session.SessionRegistry;
import io.partybroker.storage.MetaStore;
import io.partybroker.storage.MetaTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Answers the broker-to-broker calls of peer parties against this broker's sessions and metadata.
 * Failures are reported in the response status, never thrown.
 */
public final class InterPartyService {
    private static final Logger log = LoggerFactory.getLogger(InterPartyService.class);

    private final String selfPartyCode;
    private final SessionRegistry sessions;
    private final MetaStore metaStore;

    public InterPartyService(String selfPartyCode, SessionRegistry sessions, MetaStore metaStore) {
        this.selfPartyCode = selfPartyCode;
        this.sessions = sessions;
        this.metaStore = metaStore;
    }

    public ExchangeJobInfoResponse exchangeJobInfo(ExchangeJobInfoRequest req) {
        if (req == null || isBlank(req.projectId()) || isBlank(req.jobId()) || isBlank(req.clientId())) {
            return ExchangeJobInfoResponse.of(Status.of(StatusCode.BAD_REQUEST, "projectId, jobId and clientId are required"));
        }
        Optional<Session> found = sessions.get(req.jobId());
        if (found.isEmpty()) {
            return ExchangeJobInfoResponse.of(Status.of(StatusCode.SESSION_NOT_FOUND, "session " + req.jobId() + " not found"));
        }
        Session session = found.get();
        if (!session.executeInfo().projectId().equals(req.projectId())) {
            return ExchangeJobInfoResponse.of(Status.of(
                    StatusCode.BAD_REQUEST,
                    "session " + req.jobId() + " does not belong to project " + req.projectId()
            ));
        }
        session.saveEndpoint(req.clientId(), req.clientEndpoint());
        if (req.clientChecksum() != null) {
            session.executeInfo().checksums().saveRemote(req.clientId(), req.clientChecksum());
        }
        String endpoint = session.engineEndpoint(selfPartyCode).orElse("");
        if (req.serverChecksum() == null) {
            return new ExchangeJobInfoResponse(Status.ok(), null, endpoint);
        }
        Optional<Checksum> local = session.executeInfo().checksums().local(selfPartyCode);
        if (local.isEmpty()) {
            // Session exists but has not been prepared yet; the caller retries.
            return ExchangeJobInfoResponse.of(Status.of(
                    StatusCode.SESSION_NOT_FOUND,
                    "session " + req.jobId() + " has no checksum yet"
            ));
        }
        CompareResult compared = local.get().compareTo(req.serverChecksum());
        if (compared != CompareResult.EQUAL) {
            log.warn("checksum of session {} from party {} disagrees with local: {}", req.jobId(), req.clientId(), compared);
            return new ExchangeJobInfoResponse(
                    Status.of(StatusCode.DATA_INCONSISTENCY, "checksum not equal: " + compared),
                    local.get(),
                    endpoint
            );
        }
        return new ExchangeJobInfoResponse(Status.ok(), local.get(), endpoint);
    }

    public AskInfoResponse askInfo(AskInfoRequest req) {
        if (req == null || isBlank(req.projectId()) || isBlank(req.requester())) {
            return AskInfoResponse.of(Status.of(StatusCode.BAD_REQUEST, "projectId and requester are required"));
        }
        try (MetaTransaction txn = metaStore.createMetaTransaction()) {
            List<String> members = txn.getProjectMembers(req.projectId());
            if (!members.contains(req.requester())) {
                txn.finish(null);
                return AskInfoResponse.of(Status.of(
                        StatusCode.BAD_REQUEST,
                        "party " + req.requester() + " is not a member of project " + req.projectId()
                ));
            }
            List<TableMeta> owned = new ArrayList<>();
            for (TableMeta table : txn.getTableMetasByTableNames(req.projectId(), req.tableNames()).found()) {
                if (selfPartyCode.equals(table.owner())) {
                    owned.add(table);
                }
            }
            List<ColumnControl> ccls = new ArrayList<>();
            List<String> ownedNames = owned.stream().map(TableMeta::tableName).toList();
            for (MetaTransaction.ColumnPriv priv : txn.listColumnConstraints(req.projectId(), ownedNames, List.of())) {
                ccls.add(priv.toColumnControl());
            }
            txn.finish(null);
            return new AskInfoResponse(Status.ok(), owned, ccls);
        } catch (RuntimeException e) {
            log.warn("ask info of project {} from {} failed: {}", req.projectId(), req.requester(), e.getMessage());
            return AskInfoResponse.of(Status.of(StatusCode.INTERNAL, e.getMessage()));
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
