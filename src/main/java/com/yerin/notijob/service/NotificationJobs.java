package com.yerin.notijob.service;

import com.yerin.notijob.domain.JobEntity;
import com.yerin.notijob.domain.NotificationEntity;

import java.util.List;

public record NotificationJobs(NotificationEntity notification, List<JobEntity> jobs) {}
