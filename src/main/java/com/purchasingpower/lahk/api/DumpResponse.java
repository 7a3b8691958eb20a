package com.purchasingpower.lahk.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DumpResponse {

    private boolean success;
    private String error;
    private String dump;

    public static DumpResponse success(String dump) {
        return DumpResponse.builder()
            .success(true)
            .dump(dump)
            .build();
    }

    public static DumpResponse error(String error) {
        return DumpResponse.builder()
            .success(false)
            .error(error)
            .build();
    }
}
