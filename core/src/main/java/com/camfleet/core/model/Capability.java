package com.camfleet.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One supported resolution with the frame rates and codecs available at it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Capability {
    String resolution;
    List<Integer> fps;
    List<String> codec;
    String lens;
    Double maxZoom;
}
