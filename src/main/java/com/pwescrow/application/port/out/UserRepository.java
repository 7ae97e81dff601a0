package com.pwescrow.application.port.out;

import com.pwescrow.domain.model.ChatUser;
import io.vertx.core.Future;
import io.vertx.sqlclient.SqlConnection;

public interface UserRepository {

    /**
     * Insert the user or refresh its profile fields
     */
    Future<Void> upsert(ChatUser user, SqlConnection connection);
}
