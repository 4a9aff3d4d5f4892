package dev.univer.reportdispatcher.model;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@Table(name = "companies")
public class Company {
    @Id
    private String id;

    private String name;
}
