package com.tedu.juryportal.modules.group;

import com.tedu.juryportal.modules.evaluation.ScorePrecedence;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/groups")
@RequiredArgsConstructor
@Tag(name = "Groups", description = "Groups open for evaluation")
public class GroupController {

    private final GroupCatalogProperties catalog;

    @GetMapping
    @Operation(summary = "List groups ordered by id")
    public ResponseEntity<List<GroupCatalogProperties.GroupDefinition>> listGroups() {
        return ResponseEntity.ok(catalog.getGroups().stream()
                .sorted(Comparator.comparing(GroupCatalogProperties.GroupDefinition::getId, ScorePrecedence.GROUP_ORDER))
                .collect(Collectors.toList()));
    }
}
