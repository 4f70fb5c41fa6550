package com.jreinhal.haven.casework;

import com.jreinhal.haven.model.User;

/**
 * Identity shown on a report read.
 */
public record PersonSummary(String id, String firstName, String lastName, String email) {

    /** Stands in for the reporter of an anonymous report. */
    public static final PersonSummary ANONYMOUS = new PersonSummary("anonymous", "Anonymous", "Reporter", "anonymous@hidden");

    public static PersonSummary of(User user) {
        if (user == null) {
            return null;
        }
        return new PersonSummary(user.getId(), user.getFirstName(), user.getLastName(), user.getEmail());
    }
}
