package io.pingjob.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * One encrypted job definition, keyed by job id.
 */
@Document(collection = "job_records")
public class JobRecordDocument {

    @Id
    private String key;

    private String value;

    public JobRecordDocument() {
    }

    public JobRecordDocument(String key, String value) {
        this.key = key;
        this.value = value;
    }

    public String getKey() {
        return key;
    }

    public void setKey(String key) {
        this.key = key;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }
}
