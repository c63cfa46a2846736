package org.example.builtins;

import java.util.*;

/**
 * Keeps warnings in memory so the caller can report or inspect them later.
 */
public final class CollectingWarningSink implements WarningSink {

    private final List<String> messages = new ArrayList<>();

    @Override
    public void warn(String message){ messages.add(message); }

    public List<String> messages(){ return Collections.unmodifiableList(messages); }

    public boolean isEmpty(){ return messages.isEmpty(); }
}
