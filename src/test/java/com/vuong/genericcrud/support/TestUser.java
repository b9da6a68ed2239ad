package com.vuong.genericcrud.support;

import com.vuong.genericcrud.core.domain.model.BaseModel;
import com.vuong.genericcrud.core.domain.query.Attribute;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "test_user")
@Getter
@Setter
@NoArgsConstructor
public class TestUser extends BaseModel {

    public static final Attribute<TestUser, String> NAME = Attribute.of("name", String.class);
    public static final Attribute<TestUser, Integer> AGE = Attribute.of("age", Integer.class);
    public static final Attribute<TestUser, Instant> LAST_SEEN_AT = Attribute.of("lastSeenAt", Instant.class);

    private String name;

    private Integer age;

    private Instant lastSeenAt;

    @ManyToOne(fetch = FetchType.LAZY)
    private TestGroup group;

    public TestUser(String name, Integer age) {
        this.name = name;
        this.age = age;
    }

    public static TestUser named(String name) {
        return new TestUser(name, null);
    }

    public static TestUser withId(Long id) {
        TestUser user = new TestUser();
        user.setId(id);
        return user;
    }
}
