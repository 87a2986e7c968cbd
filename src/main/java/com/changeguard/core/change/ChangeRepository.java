package com.changeguard.core.change;

import com.changeguard.core.model.ChangeRecord;
import com.changeguard.core.model.ChangeStatus;

import java.util.List;
import java.util.Optional;

/**
 * Audit trail of change records. Records are inserted or replaced by id, never deleted.
 */
public interface ChangeRepository {

    void save(ChangeRecord record);

    Optional<ChangeRecord> findById(String id);

    /** All records ordered by creation time. */
    List<ChangeRecord> findAll();

    default List<ChangeRecord> findByStatus(ChangeStatus status) {
        return findAll().stream().filter(r -> r.status() == status).toList();
    }

    /** Human-readable description of where records live. */
    String location();
}
