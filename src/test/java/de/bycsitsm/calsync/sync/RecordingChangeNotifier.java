package de.bycsitsm.calsync.sync;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

class RecordingChangeNotifier implements ChangeNotifier {

    record Change(long userId, @Nullable Long targetId, ChangeType type) {
    }

    final List<Change> changes = new CopyOnWriteArrayList<>();

    @Override
    public void notify(long userId, @Nullable Long targetId, ChangeType type) {
        changes.add(new Change(userId, targetId, type));
    }

    List<ChangeType> types() {
        return changes.stream().map(Change::type).toList();
    }
}
