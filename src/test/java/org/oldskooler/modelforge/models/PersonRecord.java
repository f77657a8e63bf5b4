package org.oldskooler.modelforge.models;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.oldskooler.modelforge.annotations.Column;
import org.oldskooler.modelforge.annotations.Id;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class PersonRecord {
    @Id
    private Integer id;

    @Column(nullable = false, defaultValue = "0", doc = "Age in years")
    private int age;

    @Column(nullable = false, length = 128, doc = "Full name")
    private String name;
}
