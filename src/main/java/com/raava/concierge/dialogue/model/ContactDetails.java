package com.raava.concierge.dialogue.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ContactDetails {

    private String name;
    private String email;
    private String phone;
    private String postcode;
}
