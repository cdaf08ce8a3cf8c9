package org.socionics.ipdb;

import org.junit.jupiter.api.DisplayName;

import java.util.List;

import org.socionics.ipdb.backend.BackendKind;

@DisplayName("PersonalityStore on SQLite")
class SqlitePersonalityStoreTest extends PersonalityStoreContractTest {

    @Override
    List<BackendKind> backends() {
        return List.of(BackendKind.LIGHTWEIGHT);
    }

    @Override
    BackendKind expectedKind() {
        return BackendKind.LIGHTWEIGHT;
    }
}
