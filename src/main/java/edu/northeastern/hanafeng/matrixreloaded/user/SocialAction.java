package edu.northeastern.hanafeng.matrixreloaded.user;

public enum SocialAction {
    LOG_OUT,
    UPDATE_STATUS,
    ADD_FRIEND,
    SEND_MESSAGE
}
