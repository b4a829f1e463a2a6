package com.imperium.lexi.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.baomidou.mybatisplus.extension.handlers.JacksonTypeHandler;
import com.imperium.lexi.model.dto.context.SimilarMessage;
import com.imperium.lexi.model.dto.context.VectorSearchQuery;
import com.imperium.lexi.model.entity.MessageEmbedding;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Result;
import org.apache.ibatis.annotations.Results;
import org.apache.ibatis.annotations.Select;

import java.util.List;
import java.util.Map;

@Mapper
public interface MessageEmbeddingMapper extends BaseMapper<MessageEmbedding> {

    /**
     * pgvector 余弦距离近邻查询（HNSW vector_cosine_ops 索引），similarity = 1 - distance。
     */
    @Select("""
            <script>
            SELECT message_id, conversation_id, role, content, metadata, created_at,
                   1 - (embedding &lt;=&gt; CAST(#{q.vector} AS vector)) AS similarity
            FROM message_embeddings
            WHERE user_id = #{q.userId}
            <if test="q.conversationId != null">
              AND conversation_id = #{q.conversationId}
            </if>
            <if test="q.excludeMessageIds != null and !q.excludeMessageIds.isEmpty()">
              AND message_id NOT IN
              <foreach collection="q.excludeMessageIds" item="mid" open="(" separator="," close=")">#{mid}</foreach>
            </if>
            <if test="q.metadataFilter != null">
              <foreach collection="q.metadataFilter" index="key" item="value">
                AND metadata -&gt;&gt; #{key} = #{value}
              </foreach>
            </if>
            ORDER BY embedding &lt;=&gt; CAST(#{q.vector} AS vector)
            LIMIT #{q.fetchLimit}
            </script>
            """)
    @Results(id = "similarMessage", value = {
            @Result(column = "message_id", property = "messageId"),
            @Result(column = "conversation_id", property = "conversationId"),
            @Result(column = "role", property = "role"),
            @Result(column = "content", property = "content"),
            @Result(column = "metadata", property = "metadata", javaType = Map.class, typeHandler = JacksonTypeHandler.class),
            @Result(column = "created_at", property = "timestamp"),
            @Result(column = "similarity", property = "similarity")
    })
    List<SimilarMessage> searchNearest(@Param("q") VectorSearchQuery query);
}
