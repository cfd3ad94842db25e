package recordkvs.server;

// caller-supplied fields of a record that has not been given an id yet
public class RecordDraft {
    private final String name;
    private final String contact;
    private final int numericAttribute;

    public RecordDraft(String name, String contact, int numericAttribute) {
        this.name = name;
        this.contact = contact;
        this.numericAttribute = numericAttribute;
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
}
