package com.temple.booking.infrastructure.persistence.hall.jpa.entity;

import com.temple.booking.domain.hall.Hall;
import jakarta.persistence.*;

import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "hall")
public class HallJpaEntity {

    // 홀 ID 는 외부 홀 관리 기능이 부여
    @Id
    @Column(name = "hall_id")
    private Integer id;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "description", length = 1000)
    private String description;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "hall_image", joinColumns = @JoinColumn(name = "hall_id"))
    @OrderColumn(name = "position")
    @Column(name = "image_url", nullable = false, length = 500)
    private List<String> images = new ArrayList<>();

    protected HallJpaEntity() {}

    public HallJpaEntity(Integer id, String name, String description, List<String> images) {
        this.id = id;
        this.name = name;
        this.description = description;
        this.images = new ArrayList<>(images);
    }

    public Hall toDomain() {
        return new Hall(id, name, description, images);
    }

    public Integer getId() { return id; }
    public String getName() { return name; }
}
