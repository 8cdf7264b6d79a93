package com.visaeligibility.service.store.memory;

import com.visaeligibility.model.VisaType;
import com.visaeligibility.service.store.VisaCatalog;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryVisaCatalog implements VisaCatalog {

    private final Map<String, VisaType> visaTypes = new ConcurrentHashMap<>();

    @Override
    public Optional<VisaType> findVisaType(String visaTypeId) {
        return Optional.ofNullable(visaTypes.get(visaTypeId));
    }

    @Override
    public List<VisaType> findAll() {
        return visaTypes.values().stream()
                .sorted(Comparator.comparing(VisaType::id))
                .toList();
    }

    public void put(VisaType visaType) {
        visaTypes.put(visaType.id(), visaType);
    }

    public void clear() {
        visaTypes.clear();
    }
}
