package me.go_gradually.ivrphone.application.call.policy;

public interface CallPolicy {
    long answerTimeoutMs();
}
