package com.taskboard;

import com.taskboard.errors.ForbiddenException;
import com.taskboard.errors.NotFoundException;
import com.taskboard.models.Comment;
import com.taskboard.storage.CommentStore;

import java.util.List;
import java.util.UUID;

/**
 * Discussion on cards. Reading follows card visibility, writing needs card edit rights,
 * and only the author may change or remove a comment.
 */
public class CommentService {

    private final CardService cardService;
    private final CommentStore comments;

    public CommentService(CardService cardService, CommentStore comments) {
        this.cardService = cardService;
        this.comments = comments;
    }

    public List<Comment> listComments(String actorId, String cardId) {
        cardService.getCard(actorId, cardId);
        return comments.listByCard(cardId);
    }

    public Comment addComment(String actorId, String cardId, String body) {
        BoardService.requireText(body, "Comment body");
        cardService.editableCard(actorId, cardId);
        long now = Timestamps.next();
        return comments.save(new Comment(UUID.randomUUID().toString(), cardId, actorId, body, now, now));
    }

    public Comment updateComment(String actorId, String commentId, String body) {
        BoardService.requireText(body, "Comment body");
        Comment comment = authoredComment(actorId, commentId);
        comment.setBody(body);
        comment.setUpdatedAt(Timestamps.next());
        return comments.save(comment);
    }

    public void deleteComment(String actorId, String commentId) {
        Comment comment = authoredComment(actorId, commentId);
        comments.delete(comment.getId());
    }

    private Comment authoredComment(String actorId, String commentId) {
        BoardService.requireActor(actorId);
        Comment comment = comments.find(commentId).orElseThrow(() -> new NotFoundException("Comment", commentId));
        if (!actorId.equals(comment.getUserId())) {
            throw new ForbiddenException("Only the author can change this comment");
        }
        return comment;
    }
}
