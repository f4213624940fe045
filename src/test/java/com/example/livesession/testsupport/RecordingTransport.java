package com.example.livesession.testsupport;

import com.example.livesession.exception.TransportUnavailableException;
import com.example.livesession.transport.SessionTransport;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** In-memory transport that remembers every frame per connection and per group. */
public class RecordingTransport implements SessionTransport {

    private final Map<String, Set<String>> groups = new LinkedHashMap<>();
    private final Map<String, List<String>> inbox = new LinkedHashMap<>();
    private final List<String[]> broadcasts = new ArrayList<>();
    private final Set<String> dead = new LinkedHashSet<>();

    @Override
    public synchronized void joinGroup(String connectionId, String group) {
        groups.computeIfAbsent(group, g -> new LinkedHashSet<>()).add(connectionId);
        inbox.computeIfAbsent(connectionId, c -> new ArrayList<>());
    }

    @Override
    public synchronized void leaveGroup(String connectionId, String group) {
        Set<String> members = groups.get(group);
        if (members != null) members.remove(connectionId);
    }

    @Override
    public synchronized void leaveAllGroups(String connectionId) {
        for (Set<String> members : groups.values()) members.remove(connectionId);
    }

    @Override
    public synchronized void send(String connectionId, String text) {
        if (dead.contains(connectionId)) throw new TransportUnavailableException(connectionId, null);
        inbox.computeIfAbsent(connectionId, c -> new ArrayList<>()).add(text);
    }

    @Override
    public synchronized int broadcast(String group, String text) {
        broadcasts.add(new String[]{group, text});
        int n = 0;
        for (String id : new ArrayList<>(groups.getOrDefault(group, Set.of()))) {
            if (dead.contains(id)) continue;
            inbox.computeIfAbsent(id, c -> new ArrayList<>()).add(text);
            n++;
        }
        return n;
    }

    @Override
    public synchronized boolean isConnected(String connectionId) {
        return inbox.containsKey(connectionId) && !dead.contains(connectionId);
    }

    public synchronized void kill(String connectionId) {
        dead.add(connectionId);
    }

    public synchronized List<String> inbox(String connectionId) {
        return new ArrayList<>(inbox.getOrDefault(connectionId, List.of()));
    }

    /** Every broadcast frame as {group, json}, in publish order. */
    public synchronized List<String[]> broadcasts() {
        return new ArrayList<>(broadcasts);
    }

    public synchronized void clear() {
        broadcasts.clear();
        inbox.replaceAll((k, v) -> new ArrayList<>());
    }
}
