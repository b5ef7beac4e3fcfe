package com.docfederation.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
public class AccessProperties {

    /**
     * Header the edge gate forwards with the authenticated identity.
     */
    @NotBlank
    private String identityHeader = "X-Auth-Request-User";

    /**
     * identity -> repositories. Entries are "owner/name" or "owner/*".
     */
    private Map<String, List<String>> grants = new HashMap<>();

    /**
     * Visible to every caller, including anonymous ones.
     */
    private List<String> publicRepositories = new ArrayList<>();
}
