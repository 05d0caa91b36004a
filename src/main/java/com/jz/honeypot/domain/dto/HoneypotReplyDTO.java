package com.jz.honeypot.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class HoneypotReplyDTO {
    private String status;
    private String reply;

    public static HoneypotReplyDTO success(String reply) {
        return new HoneypotReplyDTO("success", reply);
    }
}
