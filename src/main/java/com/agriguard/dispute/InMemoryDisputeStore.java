package com.agriguard.dispute;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

public class InMemoryDisputeStore implements DisputeStore {

    private final ConcurrentSkipListMap<Long, Dispute> disputes = new ConcurrentSkipListMap<>();
    private final ConcurrentHashMap<String, Juror> jurors = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<String> registrationOrder = new CopyOnWriteArrayList<>();
    private final ConcurrentHashMap<Vote.VoteKey, Vote> votes = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Long, List<String>> assignments = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong(0);

    @Override
    public long nextDisputeId() {
        return sequence.incrementAndGet();
    }

    @Override
    public long issuedDisputeCount() {
        return sequence.get();
    }

    @Override
    public Dispute saveDispute(Dispute dispute) {
        disputes.put(dispute.disputeId(), dispute);
        return dispute;
    }

    @Override
    public Optional<Dispute> findDispute(long disputeId) {
        return Optional.ofNullable(disputes.get(disputeId));
    }

    @Override
    public List<Dispute> findAllDisputes() {
        return new ArrayList<>(disputes.values());
    }

    @Override
    public Juror saveJuror(Juror juror) {
        if (jurors.put(juror.address(), juror) == null) {
            registrationOrder.add(juror.address());
        }
        return juror;
    }

    @Override
    public Optional<Juror> findJuror(String address) {
        return Optional.ofNullable(jurors.get(address));
    }

    @Override
    public boolean jurorExists(String address) {
        return jurors.containsKey(address);
    }

    @Override
    public List<String> jurorAddresses() {
        return List.copyOf(registrationOrder);
    }

    @Override
    public long jurorCount() {
        return jurors.size();
    }

    @Override
    public Vote saveVote(Vote vote) {
        Vote existing = votes.putIfAbsent(vote.key(), vote);
        if (existing != null) {
            throw new IllegalStateException("vote already recorded for " + vote.key());
        }
        return vote;
    }

    @Override
    public Optional<Vote> findVote(Vote.VoteKey key) {
        return Optional.ofNullable(votes.get(key));
    }

    @Override
    public boolean voteExists(Vote.VoteKey key) {
        return votes.containsKey(key);
    }

    @Override
    public List<Vote> findVotes(long disputeId) {
        return votes.entrySet().stream()
            .filter(e -> e.getKey().disputeId() == disputeId)
            .map(Map.Entry::getValue)
            .sorted((a, b) -> Long.compare(a.timestamp(), b.timestamp()))
            .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public void saveAssignment(long disputeId, List<String> panel) {
        assignments.put(disputeId, List.copyOf(panel));
    }

    @Override
    public List<String> findAssignment(long disputeId) {
        return assignments.getOrDefault(disputeId, List.of());
    }
}
