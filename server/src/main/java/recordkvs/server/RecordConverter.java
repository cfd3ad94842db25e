package recordkvs.server;

import recordkvs.RecordKvs;

final class RecordConverter {

    private RecordConverter() {
    }

    static RecordKvs.Record toRecord(StoredRecord record) {
        return RecordKvs.Record.newBuilder()
                .setId(record.getId())
                .setName(record.getName())
                .setContact(record.getContact())
                .setNumericAttribute(record.getNumericAttribute())
                .setCreatedAt(record.getCreatedAt())
                .build();
    }

    static RecordDraft toDraft(RecordKvs.CreateRecordRequest request) {
        return new RecordDraft(request.getName(), request.getContact(), request.getNumericAttribute());
    }
}
