package com.example.cloudsave.network;

import java.time.Duration;

public record NetworkStatistics(
    Duration totalOnlineTime,
    Duration totalOfflineTime,
    Duration currentSessionDuration,
    int connectionSwitches) {}
