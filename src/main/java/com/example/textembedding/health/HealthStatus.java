package com.example.textembedding.health;

public enum HealthStatus {
    /** Store reachable, collection present, record count known. */
    HEALTHY,
    /** Store reachable but the collection is missing or could not be counted. */
    DEGRADED,
    /** Store unreachable. */
    UNHEALTHY
}
