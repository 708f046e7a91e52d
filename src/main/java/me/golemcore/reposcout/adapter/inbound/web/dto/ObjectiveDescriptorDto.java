package me.golemcore.reposcout.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObjectiveDescriptorDto {
    private String name;
    private int dimension;
    private String direction;
    private String description;
    private List<String> conflictsWith;
}
