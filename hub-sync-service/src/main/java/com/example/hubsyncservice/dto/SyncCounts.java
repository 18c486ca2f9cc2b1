package com.example.hubsyncservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-entity-kind row counters plus the error counter of a sync or reconcile run.
 * The error counter is the authoritative health signal of a run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncCounts {

    private int teams;
    private int projects;
    private int issues;
    private int comments;
    private int cycles;
    private int initiatives;
    private int errors;

    public void addTeams(int n) {
        teams += n;
    }

    public void addProjects(int n) {
        projects += n;
    }

    public void addIssues(int n) {
        issues += n;
    }

    public void addComments(int n) {
        comments += n;
    }

    public void addCycles(int n) {
        cycles += n;
    }

    public void addInitiatives(int n) {
        initiatives += n;
    }

    public void recordError() {
        errors++;
    }

    public void merge(SyncCounts other) {
        teams += other.teams;
        projects += other.projects;
        issues += other.issues;
        comments += other.comments;
        cycles += other.cycles;
        initiatives += other.initiatives;
        errors += other.errors;
    }
}
