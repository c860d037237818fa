package com.example.sniper.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class VenueDTO {
    private String id;
    private String name;
    private String neighborhood;
    private String locality;
    private Integer priceRange;

    private List<String> cuisine = new ArrayList<>();
}
