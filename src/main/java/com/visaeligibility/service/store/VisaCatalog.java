package com.visaeligibility.service.store;

import com.visaeligibility.model.VisaType;

import java.util.List;
import java.util.Optional;

public interface VisaCatalog {

    Optional<VisaType> findVisaType(String visaTypeId);

    List<VisaType> findAll();
}
