package com.salescrm.backend.services.email;

public record BatchResult(int sent, int failed) {

    public static final BatchResult EMPTY = new BatchResult(0, 0);

    public int attempted() {
        return sent + failed;
    }
}
