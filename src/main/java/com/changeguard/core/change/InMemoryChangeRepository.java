package com.changeguard.core.change;

import com.changeguard.core.model.ChangeRecord;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-lifetime store, used when {@code changeguard.change.store=memory} and in tests.
 */
public class InMemoryChangeRepository implements ChangeRepository {

    private final Map<String, ChangeRecord> records = new ConcurrentHashMap<>();

    @Override
    public void save(ChangeRecord record) {
        records.put(record.id(), record);
    }

    @Override
    public Optional<ChangeRecord> findById(String id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public List<ChangeRecord> findAll() {
        return records.values().stream()
                .sorted(Comparator.comparing(ChangeRecord::createdAt).thenComparing(ChangeRecord::id))
                .toList();
    }

    @Override
    public String location() {
        return "memory";
    }
}
