package recordkvs.server;

public class StoredRecord {
    private final int id;
    private final String name;
    private final String contact;
    private final int numericAttribute;
    private final String createdAt;

    public StoredRecord(int id, String name, String contact, int numericAttribute, String createdAt) {
        this.id = id;
        this.name = name;
        this.contact = contact;
        this.numericAttribute = numericAttribute;
        this.createdAt = createdAt;
    }

    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getContact() {
        return contact;
    }

    public int getNumericAttribute() {
        return numericAttribute;
    }

    public String getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return "StoredRecord{id=" + id + ", name=" + name + ", contact=" + contact
                + ", numericAttribute=" + numericAttribute + ", createdAt=" + createdAt + "}";
    }
}
