package com.residencepark.visitorparking.service;

import com.residencepark.visitorparking.repository.VisitorRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UnitDirectoryServiceTest {

    @Mock
    private VisitorRepository visitorRepository;

    @InjectMocks
    private UnitDirectoryService unitDirectoryService;

    @Test
    @DisplayName("unit list keeps the store's order and cannot be modified by callers")
    void getUnitNumbers_unmodifiable() {
        when(visitorRepository.findDistinctUnitNumbers())
                .thenReturn(new ArrayList<>(List.of("A-2-02", "B-1-01")));

        List<String> units = unitDirectoryService.getUnitNumbers();

        assertThat(units).containsExactly("A-2-02", "B-1-01");
        assertThatThrownBy(() -> units.add("C-3-03"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(units::clear)
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
