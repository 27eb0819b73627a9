package com.example.finsight.model.doc;

import lombok.Getter;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Getter
@Setter
@Document(collection = "entities")
public class EntityDoc {
    @Id
    private String id;            // CIK(10자리) 또는 티커
    @Indexed(unique = true)
    private String ticker;
    private String cik;
    private String name;
    private Instant updatedAt;
}
