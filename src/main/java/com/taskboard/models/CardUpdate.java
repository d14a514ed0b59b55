package com.taskboard.models;

/**
 * Partial card edit. Null fields are left unchanged; an empty date string clears the date.
 */
public class CardUpdate {

    private String title;
    private String body;
    private CardVisibility visibility;
    private CardStatus status;
    private String startDate;
    private String endDate;
    private String dueDate;

    public String getTitle() {
        return title;
    }

    public CardUpdate title(String title) {
        this.title = title;
        return this;
    }

    public String getBody() {
        return body;
    }

    public CardUpdate body(String body) {
        this.body = body;
        return this;
    }

    public CardVisibility getVisibility() {
        return visibility;
    }

    public CardUpdate visibility(CardVisibility visibility) {
        this.visibility = visibility;
        return this;
    }

    public CardStatus getStatus() {
        return status;
    }

    public CardUpdate status(CardStatus status) {
        this.status = status;
        return this;
    }

    public String getStartDate() {
        return startDate;
    }

    public CardUpdate startDate(String startDate) {
        this.startDate = startDate;
        return this;
    }

    public String getEndDate() {
        return endDate;
    }

    public CardUpdate endDate(String endDate) {
        this.endDate = endDate;
        return this;
    }

    public String getDueDate() {
        return dueDate;
    }

    public CardUpdate dueDate(String dueDate) {
        this.dueDate = dueDate;
        return this;
    }
}
