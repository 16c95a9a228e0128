package com.flagship.treasury_ledger.exception;

import java.util.Map;

public class NotFoundException extends TreasuryException {

    public NotFoundException(String entity, Object id) {
        super(ErrorKind.NOT_FOUND, entity + " not found: " + id,
                Map.of("entity", entity, "id", String.valueOf(id)));
    }
}
