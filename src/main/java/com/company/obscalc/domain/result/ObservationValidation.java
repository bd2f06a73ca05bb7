package com.company.obscalc.domain.result;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ObservationValidation implements Serializable {
    private static final long serialVersionUID = 1L;

    private String code;
    private List<String> messages;
}
