package io.jobvisor.config;

import io.jobvisor.internal.mongo.StatusDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.util.Objects;

/**
 * MongoDB index definitions for the status collection.
 *
 * <p>Indexes are <b>not</b> created automatically unless {@code jobvisor.ensure-indexes-on-startup=true};
 * in production they are usually managed by migrations or ops scripts.
 *
 * <h3>Indexes (collection: {@code job_statuses})</h3>
 * <ul>
 *   <li><b>idx_state_updated</b>: { state: 1, updatedAt: -1 }
 *       <br/>Used by dashboards listing jobs in a given state, newest first.</li>
 * </ul>
 * The job name is the document {@code _id}, so lookups by name need no extra index.
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.job_statuses.createIndex({ state: 1, updatedAt: -1 }, { name: "idx_state_updated" });
 * </pre>
 */
public class StatusMongoIndexConfig {

    public static final String IDX_STATE_UPDATED = "idx_state_updated";

    private final MongoTemplate mongoTemplate;

    public StatusMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(StatusDocument.class).ensureIndex(stateUpdatedIndex());
    }

    /**
     * Keys: state ASC, updatedAt DESC
     */
    public static Index stateUpdatedIndex() {
        return new Index()
                .on("state", Sort.Direction.ASC)
                .on("updatedAt", Sort.Direction.DESC)
                .named(IDX_STATE_UPDATED);
    }
}
