package org.oldskooler.modelforge.models;

import lombok.Data;
import org.oldskooler.modelforge.annotations.Id;
import org.oldskooler.modelforge.annotations.Info;

@Data
public class MutationRecord {
    @Id
    private Integer id;

    @Info("{\"allow_mutation\": false}")
    private Integer number;

    @Info("{\"allow_mutation\": true}")
    private Integer numberMut;
}
