package com.multipost.repository;

import java.util.UUID;

public interface PublicationAttemptCountRow {

    UUID getContentItemId();

    long getAttemptCount();
}
