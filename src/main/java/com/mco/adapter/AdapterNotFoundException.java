package com.mco.adapter;

import java.util.Set;

/**
 * Thrown when an orchestration asks for an adapter name that is not registered.
 */
public class AdapterNotFoundException extends RuntimeException {

    public AdapterNotFoundException(String name, Set<String> available) {
        super("Unknown adapter '" + name + "'. Registered adapters: " + available);
    }
}
