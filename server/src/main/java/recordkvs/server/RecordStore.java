package recordkvs.server;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only, in-memory store shared by every call of the service.
 * <p>
 * Id allocation and the append happen in one critical section on this object's monitor,
 * and {@link #list()} copies under the same monitor, so ids are unique and increasing and a
 * snapshot never sees a half-applied create.
 */
public class RecordStore {
    private final List<StoredRecord> records;
    private final Map<Integer, StoredRecord> index;
    private final Clock clock;
    private int nextId;

    public RecordStore() {
        this(Clock.systemUTC());
    }

    public RecordStore(Clock clock) {
        this.records = new ArrayList<>();
        this.index = new HashMap<>();
        this.clock = clock;
        this.nextId = 1;
    }

    synchronized public StoredRecord get(int id) {
        StoredRecord record = index.get(id);
        if (record == null) {
            throw new RecordNotFoundException(id);
        }
        return record;
    }

    synchronized public StoredRecord create(String name, String contact, int numericAttribute) {
        return append(new RecordDraft(name, contact, numericAttribute));
    }

    /**
     * Creates all drafts at once; the batch gets a contiguous id range, in draft order.
     */
    synchronized public List<StoredRecord> createAll(List<RecordDraft> drafts) {
        List<StoredRecord> created = new ArrayList<>(drafts.size());
        for (RecordDraft draft : drafts) {
            created.add(append(draft));
        }
        return created;
    }

    /**
     * @return a point-in-time copy of all records in insertion order
     */
    synchronized public List<StoredRecord> list() {
        return Collections.unmodifiableList(new ArrayList<>(records));
    }

    synchronized public int size() {
        return records.size();
    }

    private StoredRecord append(RecordDraft draft) {
        StoredRecord record = new StoredRecord(nextId++, draft.getName(), draft.getContact(),
                draft.getNumericAttribute(), Instant.now(clock).toString());
        records.add(record);
        index.put(record.getId(), record);
        return record;
    }
}
