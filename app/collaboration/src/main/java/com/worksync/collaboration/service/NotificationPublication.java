package com.worksync.collaboration.service;

import com.worksync.collaboration.model.NotificationRecord;
import com.worksync.collaboration.realtime.DeliveryOutcome;

/** The durable record plus how its live push went. */
public record NotificationPublication(NotificationRecord notification, DeliveryOutcome delivery) {}
