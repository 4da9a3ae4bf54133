package io.github.riemr.availability.application.dto;

import lombok.Value;

@Value
public class ResourcesChecked {
    int movers;
    int drivers;
}
