package com.codeannotation.backend.repo;

import com.codeannotation.backend.domain.*;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

@Component
public class InMemoryStore {
    public final ConcurrentHashMap<Integer, Experiment> experiments = new ConcurrentHashMap<>();
    public final ConcurrentHashMap<Integer, Assignment> assignments = new ConcurrentHashMap<>();
    public final ConcurrentHashMap<Integer, FilePair> filePairs = new ConcurrentHashMap<>();
    public final ConcurrentHashMap<Integer, User> users = new ConcurrentHashMap<>();

    // experiment ids start at 1
    public final AtomicInteger experimentSeq = new AtomicInteger();
}
