package recordkvs.server;

public class RecordNotFoundException extends RuntimeException {

    private final int id;

    public RecordNotFoundException(int id) {
        super("Record with id " + id + " not found");
        this.id = id;
    }

    public int getId() {
        return id;
    }
}
