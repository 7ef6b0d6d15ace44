package com.tedu.juryportal.modules.group;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Groups under evaluation this term. Keep {@code id} values stable across
 * terms; they are the group half of every evaluation key.
 */
@Data
@ConfigurationProperties(prefix = "jury")
public class GroupCatalogProperties {

    private List<GroupDefinition> groups = new ArrayList<>();

    @Data
    public static class GroupDefinition {
        private String id;
        private String name;
        private String description;
        private List<String> students = new ArrayList<>();
    }
}
