package com.mergington.activities.service;

import com.mergington.activities.exception.BadRequestException;
import com.mergington.activities.exception.ResourceNotFoundException;
import com.mergington.activities.repository.ActivityRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class EnrollmentServiceTest {

    @Mock
    private ActivityRepository activityRepository;

    @InjectMocks
    private EnrollmentService enrollmentService;

    @Test
    void signup_ShouldAddParticipant_WhenActivityExists() {
        when(activityRepository.existsByName("Chess Club")).thenReturn(true);

        String message = enrollmentService.signup("Chess Club", "ada@mergington.edu");

        assertEquals("Signed up ada@mergington.edu for Chess Club", message);
        verify(activityRepository).addParticipant("Chess Club", "ada@mergington.edu");
    }

    @Test
    void signup_ShouldThrowNotFound_WhenActivityUnknown() {
        when(activityRepository.existsByName("Knitting Circle")).thenReturn(false);

        ResourceNotFoundException e = assertThrows(ResourceNotFoundException.class,
                () -> enrollmentService.signup("Knitting Circle", "ada@mergington.edu"));

        assertEquals("Activity not found", e.getMessage());
        verify(activityRepository, never()).addParticipant(anyString(), anyString());
    }

    @Test
    void signup_ShouldSurfaceDuplicateSignup() {
        when(activityRepository.existsByName("Chess Club")).thenReturn(true);
        doThrow(new BadRequestException("Student is already signed up"))
                .when(activityRepository).addParticipant("Chess Club", "michael@mergington.edu");

        BadRequestException e = assertThrows(BadRequestException.class,
                () -> enrollmentService.signup("Chess Club", "michael@mergington.edu"));

        assertEquals("Student is already signed up", e.getMessage());
    }

    @Test
    void unregister_ShouldRemoveParticipant_WhenActivityExists() {
        when(activityRepository.existsByName("Chess Club")).thenReturn(true);

        String message = enrollmentService.unregister("Chess Club", "michael@mergington.edu");

        assertEquals("Unregistered michael@mergington.edu from Chess Club", message);
        verify(activityRepository).removeParticipant("Chess Club", "michael@mergington.edu");
    }

    @Test
    void unregister_ShouldThrowNotFound_WhenActivityUnknown() {
        when(activityRepository.existsByName("Knitting Circle")).thenReturn(false);

        assertThrows(ResourceNotFoundException.class,
                () -> enrollmentService.unregister("Knitting Circle", "michael@mergington.edu"));
        verify(activityRepository, never()).removeParticipant(anyString(), anyString());
    }

    @Test
    void unregister_ShouldSurfaceNotSignedUp() {
        when(activityRepository.existsByName("Chess Club")).thenReturn(true);
        doThrow(new BadRequestException("Student is not signed up for this activity"))
                .when(activityRepository).removeParticipant("Chess Club", "ada@mergington.edu");

        BadRequestException e = assertThrows(BadRequestException.class,
                () -> enrollmentService.unregister("Chess Club", "ada@mergington.edu"));

        assertEquals("Student is not signed up for this activity", e.getMessage());
    }
}
