package com.rabs.backend.modules.program.domain;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.rabs.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Recurring template from which loom instances are materialised.
 */
@Entity
@Table(name = "program")
public class Program extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "name", nullable = false, length = 120)
    private String name;

    @Column(name = "program_type", length = 40)
    private String programType;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date")
    private LocalDate endDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "repeat_pattern", nullable = false, length = 16)
    private RepeatPattern repeatPattern = RepeatPattern.WEEKLY;

    @Convert(converter = DaysOfWeekConverter.class)
    @Column(name = "days_of_week", nullable = false, length = 16)
    private Set<DayOfWeek> daysOfWeek = EnumSet.noneOf(DayOfWeek.class);

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "venue_id")
    private Venue venue;

    @Column(name = "centre_based", nullable = false)
    private boolean centreBased;

    @Enumerated(EnumType.STRING)
    @Column(name = "staff_assignment_mode", nullable = false, length = 16)
    private StaffAssignmentMode staffAssignmentMode = StaffAssignmentMode.AUTO;

    @Column(name = "additional_staff_count", nullable = false)
    private int additionalStaffCount;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    @OneToMany(mappedBy = "program", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("seq ASC")
    private List<ProgramTimeSlot> timeSlots = new ArrayList<>();

    public ProgramSchedule toSchedule() {
        return new ProgramSchedule(startDate, endDate, repeatPattern, daysOfWeek);
    }

    public boolean isManualStaffing() {
        return staffAssignmentMode == StaffAssignmentMode.MANUAL;
    }

    public void replaceTimeSlots(List<ProgramTimeSlot> slots) {
        timeSlots.clear();
        for (ProgramTimeSlot slot : slots) {
            slot.setProgram(this);
            timeSlots.add(slot);
        }
    }

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getProgramType() {
        return programType;
    }

    public void setProgramType(String programType) {
        this.programType = programType;
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public void setStartDate(LocalDate startDate) {
        this.startDate = startDate;
    }

    public LocalDate getEndDate() {
        return endDate;
    }

    public void setEndDate(LocalDate endDate) {
        this.endDate = endDate;
    }

    public RepeatPattern getRepeatPattern() {
        return repeatPattern;
    }

    public void setRepeatPattern(RepeatPattern repeatPattern) {
        this.repeatPattern = repeatPattern;
    }

    public Set<DayOfWeek> getDaysOfWeek() {
        return daysOfWeek;
    }

    public void setDaysOfWeek(Set<DayOfWeek> daysOfWeek) {
        this.daysOfWeek = daysOfWeek == null || daysOfWeek.isEmpty()
                ? EnumSet.noneOf(DayOfWeek.class)
                : EnumSet.copyOf(daysOfWeek);
    }

    public LocalTime getStartTime() {
        return startTime;
    }

    public void setStartTime(LocalTime startTime) {
        this.startTime = startTime;
    }

    public LocalTime getEndTime() {
        return endTime;
    }

    public void setEndTime(LocalTime endTime) {
        this.endTime = endTime;
    }

    public Venue getVenue() {
        return venue;
    }

    public void setVenue(Venue venue) {
        this.venue = venue;
    }

    public boolean isCentreBased() {
        return centreBased;
    }

    public void setCentreBased(boolean centreBased) {
        this.centreBased = centreBased;
    }

    public StaffAssignmentMode getStaffAssignmentMode() {
        return staffAssignmentMode;
    }

    public void setStaffAssignmentMode(StaffAssignmentMode staffAssignmentMode) {
        this.staffAssignmentMode = staffAssignmentMode;
    }

    public int getAdditionalStaffCount() {
        return additionalStaffCount;
    }

    public void setAdditionalStaffCount(int additionalStaffCount) {
        this.additionalStaffCount = additionalStaffCount;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public List<ProgramTimeSlot> getTimeSlots() {
        return timeSlots;
    }
}
