package com.camfleet.console.store;

import com.camfleet.console.registry.DeviceRecord;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * On-disk layout of {@code devices.json}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DevicesDocument {
    List<DeviceRecord> devices = new ArrayList<>();
}
