package com.camfleet.console.store;

import com.camfleet.console.profile.Profile;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * On-disk layout of {@code profiles.json}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProfilesDocument {
    List<Profile> profiles = new ArrayList<>();
}
