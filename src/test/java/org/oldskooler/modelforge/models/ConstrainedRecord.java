package org.oldskooler.modelforge.models;

import lombok.Data;
import org.oldskooler.modelforge.annotations.Column;
import org.oldskooler.modelforge.annotations.Id;
import org.oldskooler.modelforge.annotations.Info;

import java.util.List;

@Data
public class ConstrainedRecord {
    @Id
    private Integer id;

    @Info("{\"ge\": 0, \"le\": 10}")
    private Integer geLe;

    @Info("{\"gt\": 0, \"lt\": 10}")
    private Integer gtLt;

    @Info("{\"min_items\": 0, \"max_items\": 2}")
    private List<Object> items;

    @Info("{\"multiple_of\": 2}")
    private Integer multiple;

    @Column(nullable = false, defaultValue = "")
    @Info("{\"alias\": \"text\", \"description\": \"Some string\", \"example\": \"Example\","
            + " \"max_length\": 64, \"min_length\": 0, \"regex\": \"\\\\w+\", \"title\": \"SomeString\"}")
    private String string;
}
