package io.pingjob.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.Set;

/**
 * A named set of keys, e.g. the index of job ids that should be scheduled.
 */
@Document(collection = "job_sets")
public class JobSetDocument {

    @Id
    private String name;

    private Set<String> members;

    public JobSetDocument() {
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Set<String> getMembers() {
        return members;
    }

    public void setMembers(Set<String> members) {
        this.members = members;
    }
}
